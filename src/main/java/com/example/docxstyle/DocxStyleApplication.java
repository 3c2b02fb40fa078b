package com.example.docxstyle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocxStyleApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocxStyleApplication.class, args);
    }

}
