package org.metricshub.cscript.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw program text into the ordered sequence of executable lines.
 * <p>
 * Every physical line is trimmed and dropped if empty. A line starting with
 * {@code //} opens a comment region that swallows every following line up to
 * and including the next line starting with {@code \\}. A line starting with
 * {@code #} is dropped on its own. The markers are only recognized at the
 * start of a line, and an unclosed region runs to the end of the program.
 */
public final class Preprocessor {

	/** Opens a comment region. */
	public static final String BLOCK_COMMENT_OPEN = "//";

	/** Closes a comment region. */
	public static final String BLOCK_COMMENT_CLOSE = "\\\\";

	/** Comments out a single line. */
	public static final String LINE_COMMENT = "#";

	private Preprocessor() {}

	/**
	 * Preprocesses the program text read from the specified reader.
	 *
	 * @param reader program text
	 * @return the executable lines, in their original order
	 * @throws IOException upon an IO error
	 */
	public static List<String> preprocess(Reader reader) throws IOException {
		List<String> lines = new ArrayList<String>();
		boolean inComment = false;
		BufferedReader bufferedReader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
		String rawLine;
		while ((rawLine = bufferedReader.readLine()) != null) {
			String line = rawLine.trim();
			if (line.isEmpty()) {
				continue;
			}
			if (line.startsWith(BLOCK_COMMENT_OPEN)) {
				inComment = true;
				continue;
			}
			if (line.startsWith(BLOCK_COMMENT_CLOSE)) {
				inComment = false;
				continue;
			}
			if (inComment || line.startsWith(LINE_COMMENT)) {
				continue;
			}
			lines.add(line);
		}
		return lines;
	}

	/**
	 * Preprocesses the specified program text.
	 *
	 * @param source program text
	 * @return the executable lines, in their original order
	 */
	public static List<String> preprocess(String source) {
		try {
			return preprocess(new StringReader(source == null ? "" : source));
		} catch (IOException e) {
			// StringReader does not fail
			throw new UncheckedIOException(e);
		}
	}
}
