package it.ldap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LdapBer {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LdapBer.class);
        app.setBanner((environment, sourceClass, out) -> out.println("LDAP BER client"));
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }
}
