package com.inkwell;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 章节上下文组装服务主应用类
 */
@SpringBootApplication
@MapperScan("com.inkwell.repository")
public class InkwellApplication {

    public static void main(String[] args) {
        SpringApplication.run(InkwellApplication.class, args);
    }
}
