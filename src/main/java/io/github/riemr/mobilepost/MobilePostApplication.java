package io.github.riemr.mobilepost;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("io.github.riemr.mobilepost.infrastructure.mapper")
public class MobilePostApplication {

	public static void main(String[] args) {
		SpringApplication.run(MobilePostApplication.class, args);
	}

}
