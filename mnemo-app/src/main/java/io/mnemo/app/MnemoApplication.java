package io.mnemo.app;

import io.mnemo.cli.ClearCommand;
import io.mnemo.cli.CliContext;
import io.mnemo.cli.ForgetCommand;
import io.mnemo.cli.GetCommand;
import io.mnemo.cli.InitCommand;
import io.mnemo.cli.ListCommand;
import io.mnemo.cli.MnemoCliCommand;
import io.mnemo.cli.RecallCommand;
import io.mnemo.cli.RememberCommand;
import io.mnemo.cli.ServeCommand;
import io.mnemo.cli.StatusCommand;
import io.mnemo.core.api.MemoryGatewayServer;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.GatewayConfig;
import io.mnemo.core.config.model.MnemoConfig;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MnemoApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MnemoApplication.class);

    private MnemoApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        MnemoConfig config = configService.applyEnvironment(loadConfig(configService, configPath), System.getenv());
        MnemoRuntime runtime = MnemoRuntime.create(config);

        CliContext context = new CliContext(
            runtime.stores(),
            runtime.cache(),
            configService,
            configPath,
            (host, port) -> runGateway(runtime, config.gateway(), host, port)
        );

        int exitCode;
        try (runtime) {
            exitCode = commandLine(context).execute(args);
        }
        System.exit(exitCode);
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new MnemoCliCommand());
        commandLine.addSubcommand("remember", new RememberCommand(context));
        commandLine.addSubcommand("get", new GetCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("recall", new RecallCommand(context));
        commandLine.addSubcommand("forget", new ForgetCommand(context));
        commandLine.addSubcommand("clear", new ClearCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        return commandLine;
    }

    private static MnemoConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read config at {}, using defaults: {}", configPath, e.getMessage());
            return MnemoConfig.defaults();
        }
    }

    private static int runGateway(MnemoRuntime runtime, GatewayConfig gateway, String host, Integer port) throws Exception {
        String bindHost = host == null || host.isBlank() ? gateway.host() : host;
        int bindPort = port == null ? gateway.port() : port;

        CountDownLatch shutdown = new CountDownLatch(1);
        try (MemoryGatewayServer server = new MemoryGatewayServer(bindPort, bindHost, runtime.stores(), runtime.cache())) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                shutdown.countDown();
                runtime.close();
            }));
            server.start();
            System.out.println("Gateway started on http://" + bindHost + ":" + server.port());
            System.out.println("Endpoints: /memories/{category}, /memories/{category}/{id}, /memories/{category}/recall, /cache/{key}, /healthz");
            shutdown.await();
        }
        return 0;
    }
}
