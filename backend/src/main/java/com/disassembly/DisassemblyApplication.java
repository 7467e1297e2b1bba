package com.disassembly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DisassemblyApplication {

    public static void main(String[] args) {
        SpringApplication.run(DisassemblyApplication.class, args);
    }
}
