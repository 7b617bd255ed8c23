package com.tumorboard;

public class Main {

    public static void main(String[] args) {
        int exitCode = new TumorBoardCli().run(args);
        AppLogger.get().close();
        System.exit(exitCode);
    }
}
