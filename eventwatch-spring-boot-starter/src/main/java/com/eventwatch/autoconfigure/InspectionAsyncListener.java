package com.eventwatch.autoconfigure;

import com.eventwatch.core.Inspection;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

/**
 * Finishes an {@link Inspection} when an async request ends. The first of
 * error, timeout or completion wins; later callbacks are ignored by the
 * inspection itself.
 */
class InspectionAsyncListener implements AsyncListener {

    private final Inspection inspection;
    private final HttpServletResponse response;

    InspectionAsyncListener(Inspection inspection, HttpServletResponse response) {
        this.inspection = inspection;
        this.response = response;
    }

    @Override
    public void onComplete(AsyncEvent event) {
        inspection.completed(response.getStatus());
    }

    @Override
    public void onError(AsyncEvent event) {
        Throwable failure = event.getThrowable();
        if (failure != null) {
            inspection.failed(failure);
        } else {
            inspection.completed(response.getStatus());
        }
    }

    @Override
    public void onTimeout(AsyncEvent event) {
        inspection.failed(event.getThrowable() != null ? event.getThrowable() : new AsyncRequestTimeoutException());
    }

    @Override
    public void onStartAsync(AsyncEvent event) {
        // listeners are dropped when async processing restarts
        if (event.getAsyncContext() != null) {
            event.getAsyncContext().addListener(this);
        }
    }
}
