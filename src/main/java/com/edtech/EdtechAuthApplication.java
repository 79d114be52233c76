package com.edtech;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 认证服务入口。
 * <p>
 * 签名密钥、存储句柄与通知通道全部由容器在启动时装配，业务代码只通过构造器注入获取依赖。
 */
@SpringBootApplication
public class EdtechAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdtechAuthApplication.class, args);
    }
}
