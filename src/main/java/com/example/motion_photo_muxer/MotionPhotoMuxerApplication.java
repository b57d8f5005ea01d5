package com.example.motion_photo_muxer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MotionPhotoMuxerApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(MotionPhotoMuxerApplication.class, args)));
	}

}
