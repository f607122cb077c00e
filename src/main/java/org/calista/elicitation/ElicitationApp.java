package org.calista.elicitation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.elicitation.bayes.PreferenceEstimate;
import org.calista.elicitation.core.ElicitationKernel;
import org.calista.elicitation.engine.ElicitationSession;
import org.calista.elicitation.info.StoppingDiagnostics;
import org.calista.elicitation.profile.PreferenceDimension;
import org.calista.elicitation.vignette.UserContext;
import org.calista.elicitation.vignette.Vignette;
import org.calista.elicitation.vignette.VignetteOption;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Scanner;

/**
 * ElicitationApp: interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (config + library + stores)
 *  2) open a new session, or resume one by id from its snapshot
 *  3) loop: show vignette, read A/B, record, save snapshot
 *  4) print the preference summary, close kernel
 *
 * Commands: {@code a}/{@code b} answer, {@code status} prints the current estimate, {@code exit} quits
 * (the snapshot is kept, so the session can be resumed).
 */
public final class ElicitationApp {

    private static final Logger log = LogManager.getLogger(ElicitationApp.class);

    private final Path cfgPath;
    private final Path configRoot;
    private final InputStream in;
    private final PrintStream out;

    private ElicitationKernel kernel;

    public static void main(String[] args) throws Exception {
        String sessionId = (args.length > 0) ? args[0] : null;
        new ElicitationApp(Path.of("."), Path.of("config/adaptive.json"), System.in, System.out).run(sessionId);
    }

    public ElicitationApp(Path configRoot, Path cfgPath, InputStream in, PrintStream out) {
        this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
        this.cfgPath = Objects.requireNonNull(cfgPath, "cfgPath");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * @param sessionId session to resume; null starts a new one
     * @return the session as left when the loop ended
     */
    public ElicitationSession run(String sessionId) throws IOException {
        try {
            kernel = ElicitationKernel.builder()
                    .configRoot(configRoot)
                    .build(cfgPath);
            return runConsoleLoop(openOrResume(sessionId));
        } finally {
            shutdown();
        }
    }

    private ElicitationSession openOrResume(String sessionId) throws IOException {
        if (sessionId != null && !sessionId.isBlank()) {
            Optional<ElicitationSession> resumed = kernel.resumeSession(sessionId);
            if (resumed.isPresent()) {
                out.println("Resuming session " + sessionId + ".");
                return resumed.get();
            }
            out.println("No saved session " + sessionId + "; starting it fresh.");
            return kernel.openSession(sessionId);
        }
        return kernel.openSession("sess-" + Long.toHexString(System.nanoTime()));
    }

    private ElicitationSession runConsoleLoop(ElicitationSession session) throws IOException {
        UserContext ctx = UserContext.empty();
        log.info("Session {} ready. library.size={}", session.sessionId(), kernel.library().size());
        out.println("Answer with 'a' or 'b'. Type 'status' for the current estimate, 'exit' to quit.\n");

        Scanner sc = new Scanner(in, StandardCharsets.UTF_8);
        while (true) {
            Optional<Vignette> next = session.nextVignette(ctx);
            if (next.isEmpty()) {
                out.println("All done. Thank you!\n");
                printSummary(session);
                break;
            }

            Vignette v = next.get();
            printVignette(v);

            String chosen = null;
            boolean quit = false;
            while (chosen == null) {
                out.print("> ");
                if (!sc.hasNextLine()) { quit = true; break; }
                String line = sc.nextLine().trim().toLowerCase(Locale.ROOT);
                if (line.equals("exit")) { quit = true; break; }
                if (line.equals("status")) { printSummary(session); continue; }
                if (line.equals("a")) chosen = v.optionA().optionId();
                else if (line.equals("b")) chosen = v.optionB().optionId();
                else if (!line.isEmpty()) out.println("Please answer 'a' or 'b'.");
            }
            if (quit) break;

            session.recordChoice(v.vignetteId(), chosen);
            kernel.saveSession(session);
        }

        kernel.saveSession(session);
        out.println("Session " + session.sessionId() + " saved.");
        return session;
    }

    private void printVignette(Vignette v) {
        out.println(v.scenarioText());
        printOption("A", v.optionA());
        printOption("B", v.optionB());
    }

    private void printOption(String label, VignetteOption o) {
        out.println("  " + label + ") " + o.title());
        if (!o.description().isEmpty()) out.println("     " + o.description());
    }

    private void printSummary(ElicitationSession session) {
        PreferenceEstimate p = session.posterior();
        StoppingDiagnostics d = session.diagnostics();
        out.printf(Locale.ROOT, "Answered %d vignettes (%d adaptive), phase %s%n",
                d.vignettesShown, session.state().adaptiveVignettesShownCount(), session.phase());
        for (PreferenceDimension dim : PreferenceDimension.values()) {
            int i = dim.index();
            out.printf(Locale.ROOT, "  %-30s %+.3f  (sd %.3f)%n", dim.key(), p.mean()[i], Math.sqrt(p.variance(i)));
        }
        out.println();
    }

    private void shutdown() {
        if (kernel != null) kernel.close();
    }

    public ElicitationKernel getKernel() { return kernel; }
}
