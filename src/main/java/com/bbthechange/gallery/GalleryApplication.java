package com.bbthechange.gallery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class GalleryApplication {

	private static final Logger logger = LoggerFactory.getLogger(GalleryApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(GalleryApplication.class, args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Gallery API listening on port {}", event.getWebServer().getPort());
	}
}
