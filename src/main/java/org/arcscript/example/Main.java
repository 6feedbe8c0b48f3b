/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.arcscript.example;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

import org.arcscript.Arcscript;
import org.arcscript.Diagnostic;

/**
 * Arcscript for Java
 *
 * @version 1.0
 * @since 1.0
 */
public class Main {
	/** The built-in example run by --hello */
	static final String EXAMPLE =
		"answer = 2 + 2\n" +
		"if answer is 4\n" +
		"Hello world! 2+2={answer}\n" +
		"else\n" +
		"Something is wrong.\n" +
		"endif";

	/**
	 * @param args The command line options when invoked
	 */
	public static void main (String[] args) {
		System.exit (run (args, System.out, System.err));
	}

	/**
	 * Runs the command line
	 *
	 * @param args The command line options
	 * @param out Where the script output goes
	 * @param err Where file problems go
	 * @return The return code for the invoking shell
	 */
	public static int run (String[] args, PrintStream out, PrintStream err) {
		/** The Arcscript to run (loaded from disk or internal example) */
		String sourceData = null;
		int returnCode = -1;

		// Process command line flags
		List<String> params = Arrays.asList (args);
		boolean paramVersion = params.contains ("--v");
		boolean paramHelp = params.contains ("--help");
		boolean paramExample = params.contains ("--hello");

		if (args.length != 1 || paramVersion || paramHelp) { // Called with wrong arguments, version or help
			out.println ("Arcscript for Java (v " + Arcscript.VERSION_MAJOR + "." + Arcscript.VERSION_MINOR + ")\n");

			if (paramHelp || args.length != 1) {
				out.println ("Usage:  java -jar arcscript.jar scriptfile");
				out.println ("        (to evaluate an Arcscript file)");
				out.println ("");
				out.println ("Options:");
				out.println ("    --help     Show this help");
				out.println ("       --v     Show version information");
				out.println ("   --hello     Run internal example script");
			}

			return 2;
		} else if (paramExample) {
			sourceData = EXAMPLE;
		} else {
			File sourceFile = new File (args[0]);

			if (!sourceFile.exists ()) {
				err.println ("File does not exist: " + args[0]);
				return 3;
			} else if (!sourceFile.canRead ()) {
				err.println ("File read permission denied: " + args[0]);
				return 13;
			}

			sourceData = readFile (sourceFile);
			if (sourceData == null) {
				err.println ("File unknown error: " + args[0]);
				return 4;
			}
		}

		Arcscript arcscript = new Arcscript ();
		String output = arcscript.evaluate (sourceData);
		returnCode = (arcscript.diagnosticsGet ().isEmpty () ? 0 : 1);

		if (!output.isEmpty ())
			out.println (output);

		/* The engine is still available here to inspect what the script did, for
		 * example arcscript.variableGet ("answer") is 4 after --hello
		 */
		for (Diagnostic diagnostic : arcscript.diagnosticsGet ())
			out.println (diagnostic.type () + " " + diagnostic);

		return returnCode;
	}

	/**
	 * Reads a file from disk as UTF-8
	 *
	 * @param file The file object to read
	 * @return String containing the file contents, or null if file cannot be read
	 */
	private static String readFile (File file) {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream ();

		try {
			FileInputStream inputStream = new FileInputStream (file);
			try {
				byte buf[] = new byte[1024];
				int len;

				while ((len = inputStream.read (buf)) != -1)
					outputStream.write (buf, 0, len);
			} finally {
				inputStream.close ();
			}

			return outputStream.toString ("UTF-8");
		} catch (IOException e) {
			e.printStackTrace ();
		}

		return null;
	}
}
