package org.example.bookmarksync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookmarkSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookmarkSyncApplication.class, args);
    }
}
