/*
 * どこで: Matching アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: like/マッチ/チャット API を単一アプリとして起動するため
 */
package com.example.matching;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class MatchingApplication {

  public static void main(String[] args) {
    SpringApplication.run(MatchingApplication.class, args);
  }
}
