package cull.email.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.PropertySource;


@PropertySource(value = "file:${user.home}/.cull-gmail/secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication
public class CullEmailApplication {

    public static void main(String[] args) {
        SpringApplication.run(CullEmailApplication.class, args);
    }

}
