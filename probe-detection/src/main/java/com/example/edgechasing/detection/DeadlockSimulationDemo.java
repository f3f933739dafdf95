package com.example.edgechasing.detection;

/**
 * Entrypoint: {@code -n/--num_processes} (default 5) and {@code -m/--num_resources} (default 3),
 * or -Dprocesses / -Dresources. Timings come from {@link SimulationSettings#fromSystemProperties()}.
 */
public class DeadlockSimulationDemo {

    /** Parsed command line. */
    public record Options(int processes, int resources) {}

    private static final String USAGE = "usage: [-n|--num_processes N] [-m|--num_resources M]";

    public static void main(String[] args) throws InterruptedException {
        Options options = parse(args);
        var sim = Simulation.create(options.processes(), options.resources(), SimulationSettings.fromSystemProperties());
        System.out.println("created " + options.resources() + " resources: " + sim.resources());
        System.out.println("created " + options.processes() + " processes: " + sim.processes());

        var r = sim.run();
        System.out.println("Harakiri=" + r.harakiriProcessIds());
        System.out.println("RoundsStarted=" + r.roundsStarted());
        System.out.println("RoundsConfirmed=" + r.roundsConfirmed());
        System.out.println("ProbesSent=" + r.probesSent());
        if (!r.failedProcessIds().isEmpty()) {
            System.out.println("Failed=" + r.failedProcessIds());
        }
    }

    public static Options parse(String... args) {
        int processes = Integer.getInteger("processes", 5);
        int resources = Integer.getInteger("resources", 3);
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "-n":
                case "--num_processes":
                    processes = intValue(flag, args, ++i);
                    break;
                case "-m":
                case "--num_resources":
                    resources = intValue(flag, args, ++i);
                    break;
                default:
                    throw new IllegalArgumentException("unknown argument " + flag + "; " + USAGE);
            }
        }
        return new Options(processes, resources);
    }

    private static int intValue(String flag, String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " needs a value; " + USAGE);
        }
        try {
            return Integer.parseInt(args[index].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects an integer but got '" + args[index] + "'", e);
        }
    }
}
