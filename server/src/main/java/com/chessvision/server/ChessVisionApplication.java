package com.chessvision.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChessVisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChessVisionApplication.class, args);
    }
}
