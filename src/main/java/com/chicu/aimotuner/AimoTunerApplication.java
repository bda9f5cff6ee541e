package com.chicu.aimotuner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.aimotuner")
public class AimoTunerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AimoTunerApplication.class, args);
    }
}
