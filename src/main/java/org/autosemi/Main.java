package org.autosemi;

import org.autosemi.runtime.CompilerException;
import org.autosemi.runtime.ConfigurationException;

/**
 * Command line entry point.
 */
public class Main {

    public static void main(String[] args) {
        ArgumentParser.CompilerOptions compilerOptions = ArgumentParser.parseArguments(args);
        if (compilerOptions.code == null) {
            System.err.println("No program specified  (-h will show valid options)");
            System.exit(1);
        }
        int status;
        try {
            status = AsiLanguageProvider.run(compilerOptions, System.out, System.err);
        } catch (CompilerException e) {
            System.out.flush();
            System.err.print(e.getMessage());
            status = 1;
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            status = 1;
        }
        System.exit(status);
    }
}
