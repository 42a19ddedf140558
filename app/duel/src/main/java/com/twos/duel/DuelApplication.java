/*
 * どこで: Duel アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスとタイムアウト掃除のスケジュールをまとめて有効化するため
 */
package com.twos.duel;

import com.twos.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DuelApplication {

    public static void main(String[] args) {
        SpringApplication.run(DuelApplication.class, args);
    }
}
