package com.di.sheetload.backend;

import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

/**
 * Closes the backend pools when the application context shuts down.
 */
@Component
public class BackendPoolLifecycle {

    @PreDestroy
    public void closePools() {
        BackendDataSources.INSTANCE.closeAll();
    }
}
