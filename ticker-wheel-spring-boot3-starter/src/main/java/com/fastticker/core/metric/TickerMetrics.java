package com.fastticker.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class TickerMetrics {
    private final Counter enqueued;
    private final Counter done;
    private final Counter failed;
    private final Counter retried;
    private final Counter cancelled;
    private final Counter skipped;
    private final Counter claimConflict;
    private final Counter reclaimed;
    private final Counter scanErr;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final Timer execTimer;
    private final Timer waitTimer;

    private TickerMetrics(MeterRegistry reg) {
        this.enqueued = Counter.builder("ticker.enqueued").description("tickers created").register(reg);
        this.done     = Counter.builder("ticker.done").description("tickers succeeded").register(reg);
        this.failed   = Counter.builder("ticker.failed").description("tickers failed").register(reg);
        this.retried  = Counter.builder("ticker.retried").description("tickers rescheduled for retry").register(reg);
        this.cancelled = Counter.builder("ticker.cancelled").description("tickers cancelled").register(reg);
        this.skipped  = Counter.builder("ticker.skipped").description("cron occurrences skipped").register(reg);
        this.claimConflict = Counter.builder("ticker.claim.conflict").description("claims lost to another node").register(reg);
        this.reclaimed = Counter.builder("ticker.reclaimed").description("tickers released from dead nodes").register(reg);
        this.scanErr  = Counter.builder("ticker.scan.error").description("dispatch cycle error").register(reg);
        this.notifySuppressed = Counter.builder("ticker.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("ticker.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("ticker.notify.failed").description("notify failed").register(reg);
        this.execTimer = Timer.builder("ticker.exec.time").description("function execution time").register(reg);
        this.waitTimer = Timer.builder("ticker.wait.time").description("time from due to start").register(reg);
    }

    public static TickerMetrics create(MeterRegistry reg) { return new TickerMetrics(reg); }

    /** 测试或未接入监控时使用 */
    public static TickerMetrics noop() { return new TickerMetrics(new SimpleMeterRegistry()); }

    public void incEnqueued(int n){ enqueued.increment(n); }
    public void incDone(){      done.increment(); }
    public void incFailed(){    failed.increment(); }
    public void incRetried(){   retried.increment(); }
    public void incCancelled(){ cancelled.increment(); }
    public void incSkipped(){   skipped.increment(); }
    public void incClaimConflict(){ claimConflict.increment(); }
    public void incReclaimed(int n){ reclaimed.increment(n); }
    public void incScanErr(){   scanErr.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment(); }
    public void incNotifyFailed(){ notifyFailed.increment(); }
    public void incNotifySent(){ notifySent.increment(); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }
    public void recordWaitMillis(long millis){ waitTimer.record(Math.max(0, millis), TimeUnit.MILLISECONDS); }

    public double claimConflicts() { return claimConflict.count(); }
    public double scanErrors() { return scanErr.count(); }
}
