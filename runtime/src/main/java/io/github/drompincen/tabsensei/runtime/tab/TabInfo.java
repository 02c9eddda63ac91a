package io.github.drompincen.tabsensei.runtime.tab;

public record TabInfo(long id, String url, boolean active) {

    /** Only regular web pages can host an overlay. */
    public boolean canHostOverlay() {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }
}
