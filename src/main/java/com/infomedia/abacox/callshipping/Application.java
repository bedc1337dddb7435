package com.infomedia.abacox.callshipping;

import jakarta.annotation.PostConstruct;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

@SpringBootApplication
@EnableScheduling
@Log4j2
public class Application {

	public static void main(String[] args) {
		SpringApplication.run(Application.class, args);
	}

	/**
	 * CDR and CEL DATETIME columns carry no offset. JDBC reads them in the JVM zone, which is pinned to UTC.
	 */
	@PostConstruct
	public void pinTimeZone() {
		if (!"UTC".equals(TimeZone.getDefault().getID())) {
			log.info("Switching default time zone from {} to UTC", TimeZone.getDefault().getID());
			TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		}
	}
}
