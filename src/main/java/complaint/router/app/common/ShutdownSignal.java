package complaint.router.app.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Raised when the application context starts closing, so retry loops and batch passes stop early.
 */
@Slf4j
@Component
public class ShutdownSignal implements ApplicationListener<ContextClosedEvent> {
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        if (shuttingDown.compareAndSet(false, true)) {
            log.info("Shutdown requested, in-flight passes will stop at the next checkpoint");
        }
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
}
