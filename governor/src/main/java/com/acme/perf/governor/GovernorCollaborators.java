package com.acme.perf.governor;

import com.acme.perf.governor.api.CacheStatisticsProvider;
import com.acme.perf.governor.api.FrameLatencySource;
import com.acme.perf.governor.api.HostLifecycle;
import com.acme.perf.governor.api.HostMemoryReclaimer;
import com.acme.perf.governor.api.MemoryProbe;
import com.acme.perf.governor.api.NoopCacheStatisticsProvider;
import com.acme.perf.governor.api.ReportSink;
import com.acme.perf.governor.jvm.JvmMemoryProbe;
import com.acme.perf.governor.jvm.SystemGcReclaimer;
import com.acme.perf.governor.telemetry.JsonLogReportSink;

import java.util.Objects;

/**
 * External components the governor observes or commands. Only the frame source is
 * mandatory; the builder fills the rest with JVM-backed or no-op defaults.
 */
public record GovernorCollaborators(
    FrameLatencySource frameSource,
    CacheStatisticsProvider cacheProvider,
    MemoryProbe memoryProbe,
    HostLifecycle hostLifecycle,
    HostMemoryReclaimer memoryReclaimer,
    ReportSink reportSink
) {
    public GovernorCollaborators {
        Objects.requireNonNull(frameSource, "frameSource");
        Objects.requireNonNull(cacheProvider, "cacheProvider");
        Objects.requireNonNull(memoryProbe, "memoryProbe");
        Objects.requireNonNull(hostLifecycle, "hostLifecycle");
        Objects.requireNonNull(memoryReclaimer, "memoryReclaimer");
        Objects.requireNonNull(reportSink, "reportSink");
    }

    public static Builder builder(FrameLatencySource frameSource) {
        return new Builder(frameSource);
    }

    public static final class Builder {
        private final FrameLatencySource frameSource;
        private CacheStatisticsProvider cacheProvider = NoopCacheStatisticsProvider.INSTANCE;
        private MemoryProbe memoryProbe;
        private HostLifecycle hostLifecycle = HostLifecycle.NONE;
        private HostMemoryReclaimer memoryReclaimer = SystemGcReclaimer.INSTANCE;
        private ReportSink reportSink;

        private Builder(FrameLatencySource frameSource) {
            this.frameSource = Objects.requireNonNull(frameSource, "frameSource");
        }

        public Builder cacheProvider(CacheStatisticsProvider cacheProvider) {
            this.cacheProvider = cacheProvider;
            return this;
        }

        public Builder memoryProbe(MemoryProbe memoryProbe) {
            this.memoryProbe = memoryProbe;
            return this;
        }

        public Builder hostLifecycle(HostLifecycle hostLifecycle) {
            this.hostLifecycle = hostLifecycle;
            return this;
        }

        public Builder memoryReclaimer(HostMemoryReclaimer memoryReclaimer) {
            this.memoryReclaimer = memoryReclaimer;
            return this;
        }

        public Builder reportSink(ReportSink reportSink) {
            this.reportSink = reportSink;
            return this;
        }

        public GovernorCollaborators build() {
            return new GovernorCollaborators(
                frameSource,
                cacheProvider,
                memoryProbe == null ? new JvmMemoryProbe() : memoryProbe,
                hostLifecycle,
                memoryReclaimer,
                reportSink == null ? new JsonLogReportSink() : reportSink
            );
        }
    }
}
