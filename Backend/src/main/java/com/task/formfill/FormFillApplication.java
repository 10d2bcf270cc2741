package com.task.formfill;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormFillApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormFillApplication.class, args);
    }
}
