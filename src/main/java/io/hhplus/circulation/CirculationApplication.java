package io.hhplus.circulation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // 멱등성 복구 스윕, 감사 누락 재처리
public class CirculationApplication {

	public static void main(String[] args) {
		SpringApplication.run(CirculationApplication.class, args);
	}

}
