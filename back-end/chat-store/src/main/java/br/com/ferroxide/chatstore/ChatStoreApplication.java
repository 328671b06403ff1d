package br.com.ferroxide.chatstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChatStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatStoreApplication.class, args);
    }
}
