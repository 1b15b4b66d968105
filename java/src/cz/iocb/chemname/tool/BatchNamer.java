/*
 * Copyright (C) 2015-2017 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.chemname.tool;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.engine.NameGenerator;
import cz.iocb.chemname.engine.NameResult;
import cz.iocb.chemname.engine.NamingWarning;
import cz.iocb.chemname.engine.TraceEntry;
import cz.iocb.chemname.molecule.StructuralException;
import cz.iocb.chemname.rules.NomenclatureTables;
import cz.iocb.chemname.shared.ConfigurationProperties;



/**
 * Names SMILES given on the command line or read from a file, one per line. Every input yields one tab separated
 * line with the SMILES, the name, the confidence and the naming method.
 */
public class BatchNamer
{
    private static final Logger LOGGER = LogManager.getLogger(BatchNamer.class);

    private static final String HELP_MESSAGE = StringUtils.join(new String[] {
            "Generates IUPAC names for SMILES given as arguments or read from the input file. ",
            "Options override the values of the configuration file." }, "");

    private final NameGenerator generator;
    private final boolean trace;


    public BatchNamer(NameGenerator generator, boolean trace)
    {
        this.generator = generator;
        this.trace = trace;
    }


    /**
     * Names one SMILES and writes the result line, followed by the trace when requested.
     *
     * @return false if the SMILES could not be named
     */
    public boolean process(String smiles, PrintWriter out)
    {
        NameResult result;

        try
        {
            result = generator.generateNameFromSmiles(smiles);
        }
        catch(CDKException | StructuralException e)
        {
            LOGGER.warn("cannot parse {}: {}", smiles, e.getMessage());
            out.println(smiles + "\t\t0.00\terror");
            return false;
        }

        String method = result.getMethod() == null ? "error" : result.getMethod().toString();
        String confidence = String.format(Locale.ROOT, "%.2f", result.getConfidence());
        out.println(smiles + "\t" + result.getName() + "\t" + confidence + "\t" + method);

        if(trace)
        {
            for(TraceEntry entry : result.getTrace())
                out.println("#\t" + entry);

            for(NamingWarning warning : result.getWarnings())
                out.println("#\t" + warning);
        }

        return !result.isError();
    }


    public int process(BufferedReader reader, PrintWriter out) throws IOException
    {
        int failed = 0;
        int count = 0;
        String line;

        while((line = reader.readLine()) != null)
        {
            String smiles = line.trim();

            if(smiles.isEmpty() || smiles.startsWith("#"))
                continue;

            // only the first column holds the structure
            smiles = smiles.split("\\s+")[0];

            if(!process(smiles, out))
                failed++;

            if(++count % 1000 == 0)
                LOGGER.info("{} structures named", count);
        }

        LOGGER.info("{} structures named, {} failed", count, failed);
        return failed;
    }


    private static Options options()
    {
        Options options = new Options();

        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("FILE")
                .desc("configuration properties file").build());
        options.addOption(Option.builder("r").longOpt("rules").hasArg().argName("FILE")
                .desc("external nomenclature rule table").build());
        options.addOption(Option.builder("i").longOpt("input").hasArg().argName("FILE")
                .desc("file with one SMILES per line").build());
        options.addOption(Option.builder("o").longOpt("output").hasArg().argName("FILE")
                .desc("output file, standard output by default").build());
        options.addOption(Option.builder("t").longOpt("trace").desc("print the rule trace").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this message").build());

        return options;
    }


    public static void main(String[] args) throws IOException
    {
        Options options = options();
        HelpFormatter formatter = new HelpFormatter();
        formatter.setWidth(100);

        CommandLine line;

        try
        {
            CommandLineParser parser = new DefaultParser();
            line = parser.parse(options, args);
        }
        catch(ParseException e)
        {
            LOGGER.error("argument parsing failed: {}", e.getMessage());
            formatter.printHelp(BatchNamer.class.getCanonicalName(), HELP_MESSAGE, options, null, true);
            System.exit(1);
            return;
        }

        if(line.hasOption("help"))
        {
            formatter.printHelp(BatchNamer.class.getCanonicalName(), HELP_MESSAGE, options, null, true);
            return;
        }

        ConfigurationProperties properties = line.hasOption("config") ?
                new ConfigurationProperties(line.getOptionValue("config")) : new ConfigurationProperties();

        String rules = line.getOptionValue("rules", properties.getProperty("chemname.rules"));
        String input = line.getOptionValue("input", properties.getProperty("chemname.input"));
        String output = line.getOptionValue("output", properties.getProperty("chemname.output"));
        boolean trace = line.hasOption("trace") || properties.getBooleanProperty("chemname.trace", false);

        NomenclatureTables tables = rules != null ? NomenclatureTables.load(new File(rules)) :
                NomenclatureTables.getDefault();

        BatchNamer namer = new BatchNamer(new NameGenerator(tables), trace);
        int failed = 0;

        try(PrintWriter out = output != null ?
                new PrintWriter(new OutputStreamWriter(new FileOutputStream(output), StandardCharsets.UTF_8)) :
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)))
        {
            List<String> smiles = new ArrayList<String>(line.getArgList());

            for(String item : smiles)
                if(!namer.process(item, out))
                    failed++;

            if(input != null)
            {
                try(BufferedReader reader = new BufferedReader(
                        new InputStreamReader(new FileInputStream(input), StandardCharsets.UTF_8)))
                {
                    failed += namer.process(reader, out);
                }
            }
        }

        if(failed > 0)
            System.exit(2);
    }
}
