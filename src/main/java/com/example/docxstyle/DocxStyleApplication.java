package com.example.docxstyle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocxStyleApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocxStyleApplication.class, args);
    }

}
