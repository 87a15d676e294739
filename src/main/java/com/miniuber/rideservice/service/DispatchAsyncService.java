package com.miniuber.rideservice.service;

import com.miniuber.rideservice.dto.DispatchPassReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a manually triggered dispatch pass on dispatchTaskExecutor so the HTTP
 * request returns immediately. Lives in its own bean so @Async goes through the proxy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchAsyncService {

    private final DispatchScheduler dispatchScheduler;

    @Async("dispatchTaskExecutor")
    public CompletableFuture<DispatchPassReport> runPassAsync() {
        log.info("Manual dispatch pass triggered");
        return CompletableFuture.completedFuture(dispatchScheduler.runPass());
    }
}
