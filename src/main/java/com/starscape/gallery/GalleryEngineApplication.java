package com.starscape.gallery;

import com.starscape.gallery.common.config.GalleryProperties;
import com.starscape.gallery.common.config.GitHubProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({GalleryProperties.class, GitHubProperties.class})
public class GalleryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GalleryEngineApplication.class, args);
    }
}
