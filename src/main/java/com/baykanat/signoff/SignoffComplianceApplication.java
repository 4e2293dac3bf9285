package com.baykanat.signoff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile periyodik rapor hesaplama ve retention cleanup. */
@SpringBootApplication
@EnableScheduling
public class SignoffComplianceApplication {

	public static void main(String[] args) {
		SpringApplication.run(SignoffComplianceApplication.class, args);
	}

}
