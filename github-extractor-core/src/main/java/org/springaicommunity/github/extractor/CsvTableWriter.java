package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes row records to CSV files in a job's output directory.
 *
 * <p>
 * Column names and order come from the row type's Jackson annotations. The file is
 * written to a {@code .part} sibling and moved into place, so a file under its final name
 * is always complete.
 */
public class CsvTableWriter {

	private static final Logger logger = LoggerFactory.getLogger(CsvTableWriter.class);

	private final CsvMapper csvMapper;

	public CsvTableWriter(CsvMapper csvMapper) {
		this.csvMapper = csvMapper;
	}

	public CsvTableWriter() {
		this(ObjectMapperFactory.createCsvMapper());
	}

	/**
	 * Write {@code rows} with a header line to {@code outputDir/fileName}.
	 * @return the path of the completed file
	 * @throws IllegalArgumentException if {@code fileName} does not name a file directly
	 * inside {@code outputDir}
	 */
	public <T> Path write(Path outputDir, String fileName, Class<T> rowType, List<T> rows) {
		Path directory = outputDir.toAbsolutePath().normalize();
		Path target = directory.resolve(fileName).normalize();
		if (!directory.equals(target.getParent())) {
			throw new IllegalArgumentException("CSV file name escapes the output directory: " + fileName);
		}
		Path partial = directory.resolve(target.getFileName() + ".part");
		CsvSchema schema = csvMapper.schemaFor(rowType).withHeader().withLineSeparator("\n");

		try {
			Files.createDirectories(directory);
			try (Writer writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8);
					SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
				sequence.writeAll(rows);
			}
			moveIntoPlace(partial, target);
			logger.info("Wrote {} rows to {}", rows.size(), target);
			return target;
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write CSV file: " + target, e);
		}
	}

	private static void moveIntoPlace(Path partial, Path target) throws IOException {
		try {
			Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

}
