/**
 * CurrentAffairsDigest is the entry point of the daily digest run.
 * - Loads logging.properties and reads the configuration from the environment.
 * - Builds the PipelineContext once and hands it to DigestPipeline.
 * - A PipelineAbortedException is logged and ends the process with exit status 1.
 */

package com.example.affairsdigest;

import com.example.affairsdigest.config.DigestConfig;
import com.example.affairsdigest.exception.PipelineAbortedException;
import com.example.affairsdigest.service.DigestPipeline;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class CurrentAffairsDigest {
    public static void main(String[] args) {
        configureLogging();
        Logger logger = Logger.getLogger(CurrentAffairsDigest.class.getName());

        DigestConfig config;
        try {
            config = DigestConfig.fromEnvironment(System.getenv());
        } catch (IllegalArgumentException e) {
            logger.severe("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }

        int status = 0;
        try (PipelineContext context = PipelineContext.fromConfig(config, logger)) {
            new DigestPipeline(context).run();
        } catch (PipelineAbortedException e) {
            logger.severe("An error occurred: " + e.getMessage());
            status = 1;
        }
        System.exit(status);
    }

    private static void configureLogging() {
        try (InputStream in = CurrentAffairsDigest.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
