package io.jerry.cli;

@FunctionalInterface
public interface ServeRunner {
    int run() throws Exception;
}
