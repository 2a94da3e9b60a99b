package li.cil.dtk;

import li.cil.dtk.api.DeviceTreeException;
import li.cil.dtk.binding.BindingResolver;
import li.cil.dtk.device.Device;
import li.cil.dtk.device.DeviceGraph;
import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.dts.DeviceTreeSource;
import li.cil.dtk.dts.DeviceTreeWriter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public final class Main {
    private static final String USAGE = "usage: dtk [-I <include-dir>]... [-b <bindings-dir>] <file.dts>";

    private final List<Path> includePath = new ArrayList<>();
    private Path bindingsDirectory;
    private Path sourceFile;

    public static void main(final String[] args) {
        final Main main = new Main();
        if (!main.parseArguments(args)) {
            System.err.println(USAGE);
            System.exit(2);
        }

        try {
            main.run(System.out);
        } catch (final DeviceTreeException | IOException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }

    private boolean parseArguments(final String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-I" -> {
                    if (++i >= args.length) {
                        return false;
                    }
                    includePath.add(Paths.get(args[i]));
                }
                case "-b" -> {
                    if (++i >= args.length) {
                        return false;
                    }
                    bindingsDirectory = Paths.get(args[i]);
                }
                default -> {
                    if (sourceFile != null || args[i].startsWith("-")) {
                        return false;
                    }
                    sourceFile = Paths.get(args[i]);
                }
            }
        }
        return sourceFile != null;
    }

    private void run(final PrintStream out) throws DeviceTreeException, IOException {
        final DeviceTree tree = DeviceTreeSource.parse(sourceFile, includePath);
        if (bindingsDirectory == null) {
            out.print(DeviceTreeWriter.write(tree));
            return;
        }

        final DeviceGraph graph = DeviceGraph.build(tree, BindingResolver.load(bindingsDirectory, tree));
        for (final Device device : graph.getDevices()) {
            if (device.getBinding() == null) {
                continue;
            }

            out.printf("%s (%s)%s%n", device.getPath(), device.getMatchingCompat(), device.isEnabled() ? "" : " [disabled]");
            device.getRegisters().forEach(register -> out.println("\t" + register));
            device.getInterrupts().forEach(interrupt -> out.println("\t" + interrupt));
            device.getGpios().values().forEach(gpios -> gpios.forEach(gpio -> out.println("\t" + gpio)));
            device.getClocks().forEach(clock -> out.println("\t" + clock));
            device.getPwms().forEach(pwm -> out.println("\t" + pwm));
            device.getProperties().values().forEach(property -> out.println("\t" + property));
        }
    }
}
