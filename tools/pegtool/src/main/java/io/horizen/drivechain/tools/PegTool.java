package io.horizen.drivechain.tools;

import io.horizen.drivechain.tools.utils.CommandProcessor;
import io.horizen.drivechain.tools.utils.ConsolePrinter;

import java.io.File;
import java.util.Scanner;

// Entry point: one command from the program arguments, or an interactive session otherwise.
public class PegTool {
    public static void main(String[] args) {
        // Log properties have to be set before the first logger is created.
        System.setProperty("logFilename", System.getProperty("java.io.tmpdir") + File.separator + "drivechain_peg_tool.log");
        System.setProperty("logFileLevel", "all");
        System.setProperty("logConsoleLevel", "error");

        CommandProcessor processor = new PegToolCommandProcessor(new ConsolePrinter());
        if (args.length > 0)
            processor.runOnce(args);
        else
            processor.runInteractive(new Scanner(System.in));
    }
}
