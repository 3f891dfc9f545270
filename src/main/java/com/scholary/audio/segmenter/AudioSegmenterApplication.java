package com.scholary.audio.segmenter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AudioSegmenterApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudioSegmenterApplication.class, args);
  }
}
