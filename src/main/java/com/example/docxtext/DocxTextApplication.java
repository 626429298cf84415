package com.example.docxtext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocxTextApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocxTextApplication.class, args);
    }

}
