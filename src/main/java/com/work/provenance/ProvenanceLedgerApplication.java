package com.work.provenance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后通过 REST 接口访问委托引擎与 release 状态机。
 */
@SpringBootApplication
public class ProvenanceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProvenanceLedgerApplication.class, args);
    }
}
