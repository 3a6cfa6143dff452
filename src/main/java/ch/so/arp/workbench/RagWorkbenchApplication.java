package ch.so.arp.workbench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RagWorkbenchApplication {

    public static void main(String[] args) {
        SpringApplication.run(RagWorkbenchApplication.class, args);
    }
}
