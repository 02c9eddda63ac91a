package io.github.drompincen.tabsensei.runtime.reminder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingOsNotifier implements OsNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingOsNotifier.class);

    @Override
    public void notify(String title, String text) {
        log.info("[{}] {}", title, text);
    }
}
