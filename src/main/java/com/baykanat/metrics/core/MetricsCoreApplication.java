package com.baykanat.metrics.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Uygulama giriş noktası; metric point store, sorgu, drilldown ve segment API'leri. */
@SpringBootApplication
public class MetricsCoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(MetricsCoreApplication.class, args);
	}

}
