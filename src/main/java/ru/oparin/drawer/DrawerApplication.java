package ru.oparin.drawer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DrawerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrawerApplication.class, args);
    }
}
