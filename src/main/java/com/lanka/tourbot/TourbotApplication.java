package com.lanka.tourbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sri Lanka 旅遊對話引擎主應用程式
 * 支援英文、僧伽羅文、泰米爾文的規則式旅遊問答
 */
@SpringBootApplication
@EnableScheduling
public class TourbotApplication {

    public static void main(String[] args) {
        SpringApplication.run(TourbotApplication.class, args);
        System.out.println("=================================");
        System.out.println("  Sri Lanka Tourbot 已啟動！");
        System.out.println("  API: http://localhost:8080/api/chat");
        System.out.println("=================================");
    }
}
