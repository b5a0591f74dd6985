package com.dcruver.smoothwrite.config;

import com.dcruver.smoothwrite.io.NoteCodec;
import com.dcruver.smoothwrite.io.NoteStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Storage and auto-save infrastructure beans.
 */
@Configuration
@Slf4j
public class NotesConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NoteCodec noteCodec(Clock clock) {
        return new NoteCodec(clock);
    }

    @Bean
    public NoteStorage noteStorage(@Value("${smoothwrite.notes-path}") String notesPath, NoteCodec noteCodec) {
        if (notesPath == null || notesPath.isBlank()) {
            throw new IllegalStateException("smoothwrite.notes-path must not be blank");
        }
        Path root = Paths.get(expandHome(notesPath));
        log.info("Notes directory: {}", root.toAbsolutePath());
        return new NoteStorage(root, noteCodec);
    }

    /**
     * Single thread so that auto-save deadlines fire one at a time, in order.
     */
    @Bean
    public ThreadPoolTaskScheduler autoSaveTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("note-autosave-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    static String expandHome(String path) {
        if (path.equals("~")) {
            return System.getProperty("user.home");
        }
        if (path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }
}
