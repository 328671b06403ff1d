package br.com.ferroxide.chatstore.domain;

import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A user's presence in a room. The (room, user) pair is the identity; there is no surrogate key.
 * Rows are written with plain inserts by {@link br.com.ferroxide.chatstore.repository.MembershipRepository}
 * so a duplicate pair fails on the primary key instead of being merged.
 */
@Entity
@Table(name = "rooms_users")
@Getter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class Membership {

    @EmbeddedId
    private MembershipId id;

    @MapsId("roomId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id")
    private Room room;

    @MapsId("userId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id")
    private User user;
}
