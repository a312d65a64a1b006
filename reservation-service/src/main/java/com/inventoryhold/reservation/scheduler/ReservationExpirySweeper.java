package com.inventoryhold.reservation.scheduler;

import com.inventoryhold.common.logging.RequestIdFilter;
import com.inventoryhold.reservation.domain.service.ReservationService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically expires pending reservations whose hold window has elapsed and gives their capacity
 * back, so a booking saga that crashed or never called back cannot keep inventory forever.
 *
 * Started and stopped with the application context. A failed sweep is logged and the affected
 * reservations simply stay pending until the next tick.
 */
@Slf4j
@Component
public class ReservationExpirySweeper implements SmartLifecycle {

    private final ReservationService reservationService;
    private final TaskScheduler taskScheduler;
    private final AtomicLong sweepCounter = new AtomicLong();

    @Value("${inventory.reservation.expiry-job-enabled:true}")
    private boolean enabled = true;

    @Value("${inventory.reservation.expiry-job-interval-ms:60000}")
    private long intervalMs = 60000;

    private volatile ScheduledFuture<?> scheduledSweep;

    public ReservationExpirySweeper(ReservationService reservationService,
                                    @Qualifier("expirySweeperScheduler") TaskScheduler taskScheduler) {
        this.reservationService = reservationService;
        this.taskScheduler = taskScheduler;
    }

    @Override
    public synchronized void start() {
        if (!enabled) {
            log.info("Reservation expiry sweeper disabled");
            return;
        }
        if (scheduledSweep != null) {
            return;
        }
        scheduledSweep = taskScheduler.scheduleWithFixedDelay(this::sweep, Duration.ofMillis(intervalMs));
        log.info("Reservation expiry sweeper started (every {} ms)", intervalMs);
    }

    @Override
    public synchronized void stop() {
        if (scheduledSweep == null) {
            return;
        }
        scheduledSweep.cancel(false);
        scheduledSweep = null;
        log.info("Reservation expiry sweeper stopped");
    }

    @Override
    public boolean isRunning() {
        return scheduledSweep != null;
    }

    /**
     * One tick. Never throws.
     *
     * @return number of reservations expired, 0 when the sweep failed
     */
    public int sweep() {
        MDC.put(RequestIdFilter.MDC_TRACE_ID, "sweep-" + sweepCounter.incrementAndGet());
        try {
            int expired = reservationService.expireOverdueReservations();
            if (expired > 0) {
                log.info("Expired {} overdue reservation(s)", expired);
            }
            return expired;
        } catch (Exception e) {
            log.error("Reservation expiry sweep failed; overdue reservations stay pending until next run", e);
            return 0;
        } finally {
            MDC.remove(RequestIdFilter.MDC_TRACE_ID);
        }
    }
}
