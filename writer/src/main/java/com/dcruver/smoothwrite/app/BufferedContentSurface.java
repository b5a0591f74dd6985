package com.dcruver.smoothwrite.app;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory content surface backing the shell front end.
 */
@Component
@Slf4j
public class BufferedContentSurface implements ContentSurface {

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String content = "";

    @Override
    public String getContent() {
        return content;
    }

    @Override
    public void setContent(String html) {
        String next = html == null ? "" : html;
        if (next.equals(content)) {
            return;
        }
        content = next;
        fireContentChanged();
    }

    @Override
    public void addContentChangeListener(Runnable listener) {
        listeners.add(listener);
    }

    private void fireContentChanged() {
        for (Runnable listener : listeners) {
            listener.run();
        }
    }
}
