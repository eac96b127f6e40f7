package com.acme.perf.governor.sim;

import com.acme.perf.governor.AdaptiveGovernor;
import com.acme.perf.governor.GovernorCollaborators;
import com.acme.perf.governor.GovernorConfig;
import com.acme.perf.governor.animation.AnimationHandle;
import com.acme.perf.governor.jvm.JvmMemoryProbe;
import com.acme.perf.governor.telemetry.JsonLogReportSink;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Runs a governor against a synthetic frame source that alternates between smooth and janky
 * phases, registering and completing animations along the way.
 *
 * <p>Usage: {@code GovernorSimulationMain [durationSeconds] [phaseSeconds]}. Governor settings
 * come from the environment (see {@code GovernorEnvKeys}).
 */
public final class GovernorSimulationMain {
    private static final Logger LOG = Logger.getLogger(GovernorSimulationMain.class.getName());

    private static final double FRAMES_PER_SECOND = 60.0d;
    private static final double SMOOTH_FRAME_MS = 16.0d;
    private static final double JANKY_FRAME_MS = 40.0d;
    private static final double JITTER_MS = 2.0d;
    private static final int MAX_LIVE_ANIMATIONS = 8;

    private GovernorSimulationMain() {}

    public static void main(String[] args) throws Exception {
        loadLoggingConfig();
        long durationSeconds = args.length > 0 ? Long.parseLong(args[0]) : 20L;
        long phaseSeconds = args.length > 1 ? Long.parseLong(args[1]) : 5L;

        GovernorConfig config = GovernorConfig.fromEnv();
        SyntheticFrameSource frames = new SyntheticFrameSource(FRAMES_PER_SECOND,
            SyntheticFrameSource.jittered(SMOOTH_FRAME_MS, JITTER_MS));
        AdaptiveGovernor governor = new AdaptiveGovernor(GovernorCollaborators.builder(frames)
            .memoryProbe(new JvmMemoryProbe())
            .reportSink(new JsonLogReportSink("governor-sim"))
            .build());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            governor.dispose();
            frames.close();
        }, "governor-sim-shutdown"));

        governor.initialize(config);
        frames.start();

        Deque<AnimationHandle> animations = new ArrayDeque<>();
        boolean janky = false;
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);
        long nextPhase = System.nanoTime() + TimeUnit.SECONDS.toNanos(phaseSeconds);
        int tick = 0;
        while (System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(250L);
            tick++;
            if (System.nanoTime() >= nextPhase) {
                janky = !janky;
                frames.useProfile(SyntheticFrameSource.jittered(janky ? JANKY_FRAME_MS : SMOOTH_FRAME_MS, JITTER_MS));
                LOG.info("Switched frame profile to " + (janky ? "janky" : "smooth"));
                nextPhase = System.nanoTime() + TimeUnit.SECONDS.toNanos(phaseSeconds);
            }
            if (tick % 2 == 0) {
                AnimationHandle handle = governor.registerAnimation(300L + (tick % 5) * 200L, "sim-" + tick);
                animations.addLast(handle);
                LOG.fine(() -> "Registered " + handle);
            }
            while (animations.size() > MAX_LIVE_ANIMATIONS) {
                governor.completeAnimation(animations.removeFirst());
            }
        }

        governor.getSnapshot()
            .thenAccept(s -> LOG.info("Final snapshot: " + s.toMap()))
            .get(5, TimeUnit.SECONDS);
        governor.forceMemoryOptimization().get(10, TimeUnit.SECONDS);
        governor.dispose();
        frames.close();
    }

    private static void loadLoggingConfig() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = GovernorSimulationMain.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.warning("Could not load logging.properties: " + e.getClass().getSimpleName());
        }
    }
}
