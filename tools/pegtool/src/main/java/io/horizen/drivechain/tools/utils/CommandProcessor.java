package io.horizen.drivechain.tools.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.Scanner;

/**
 * Base of the tool command processors: reads commands with their JSON argument, either from the
 * program arguments or line by line, and reports the failure of a command without stopping the tool.
 */
public abstract class CommandProcessor {
    private static final Logger log = LogManager.getLogger(CommandProcessor.class);

    public static final String EXIT_COMMAND = "exit";

    protected final MessagePrinter printer;
    protected final ObjectMapper objectMapper = new ObjectMapper();

    public CommandProcessor(MessagePrinter printer) {
        this.printer = printer;
    }

    public abstract void processCommand(String input) throws Exception;

    protected abstract void printUsageMsg();

    // Single command built from the program arguments.
    public void runOnce(String[] args) {
        String input = String.join(" ", args);
        log.info("Processing single command: {}", input);
        execute(input);
    }

    // Processes lines until "exit" or the end of the input.
    public void runInteractive(Scanner scanner) {
        printer.print("Tool successfully started...\nPlease, enter the command:");
        while (scanner.hasNextLine()) {
            String input = scanner.nextLine().trim();
            if (input.isEmpty())
                continue;
            if (input.equals(EXIT_COMMAND))
                break;
            log.info("Processing command: {}", input);
            execute(input);
        }
        log.info("Interactive session finished");
    }

    private void execute(String input) {
        try {
            processCommand(input);
        } catch (Exception e) {
            log.error("Command failed: " + input, e);
            printer.print(e.getMessage());
        }
    }

    // Command structure is:
    // 1) <command name>
    // 2) <command name> <json argument>
    // 3) <command name> -f <path to file with json argument>
    protected Command parseCommand(String input) throws IOException {
        String[] inputData = input.trim().split(" ", 2);

        if (inputData.length == 1)
            return new Command(inputData[0], objectMapper.createObjectNode());

        String jsonData;
        String commandArguments = inputData[1].trim();
        if (commandArguments.startsWith("-f ")) {
            // Remove '-f', possible around whitespaces and/or quotes
            String filePath = commandArguments.replaceAll("^-f\\s*\"*|\"$", "");
            try {
                jsonData = new String(Files.readAllBytes(Paths.get(filePath)), StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                throw new IOException(String.format("Error: Input data file '%s' not found.%nSee 'help' for usage guideline.", filePath));
            }
        } else {
            jsonData = commandArguments;
        }

        JsonNode jsonNode;
        try {
            jsonNode = objectMapper.readTree(jsonData);
        } catch (IOException e) {
            throw new IOException(String.format("Error: Invalid input data format '%s'. Json expected.%nSee 'help' for usage guideline.", jsonData), e);
        }

        return new Command(inputData[0], jsonNode);
    }

    protected void printUnsupportedCommandMsg(String command) {
        printer.print(String.format("Error: unsupported command '%s'.\nSee 'help' for usage guideline.", command));
    }
}
