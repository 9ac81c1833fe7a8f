package io.mnemo.cli;

@FunctionalInterface
public interface GatewayRunner {
    int run(String host, Integer port) throws Exception;
}
