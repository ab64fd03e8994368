package org.cardiocore.utils;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import au.com.bytecode.opencsv.CSVReader;

/**
 * Reads delimited text into rows of trimmed cells. Blank lines are dropped.
 */
public class CsvTableReader {

	private final char separator;

	public CsvTableReader() {
		this(',');
	}

	public CsvTableReader(char separator) {
		this.separator = separator;
	}

	public List<String[]> readRows(Reader source) throws IOException {
		List<String[]> rows = new ArrayList<String[]>();
		CSVReader reader = new CSVReader(source, separator);
		try {
			String[] nextLine;
			while ((nextLine = reader.readNext()) != null) {
				if (isBlank(nextLine)) {
					continue;
				}
				String[] cells = new String[nextLine.length];
				for (int i = 0; i < nextLine.length; i++) {
					cells[i] = nextLine[i].trim();
				}
				rows.add(cells);
			}
		} finally {
			reader.close();
		}
		return rows;
	}

	private static boolean isBlank(String[] line) {
		for (String cell : line) {
			if (cell != null && !cell.trim().isEmpty()) {
				return false;
			}
		}
		return true;
	}
}
