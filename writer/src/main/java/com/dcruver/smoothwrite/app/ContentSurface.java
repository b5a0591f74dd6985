package com.dcruver.smoothwrite.app;

/**
 * The editing surface a note is rendered into.
 *
 * Listeners are notified in registration order whenever the content
 * actually changes, whether through {@link #setContent(String)} or through
 * user edits.
 */
public interface ContentSurface {

    String getContent();

    void setContent(String html);

    void addContentChangeListener(Runnable listener);
}
