package com.example.demo.sheets.service;

import com.example.demo.sheets.exception.OutputLocationException;
import com.example.demo.sheets.model.OutputFormat;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds output file paths of the form {@code <dir>/<source stem>.<sheet name>.<ext>}.
 */
@Component
public class OutputPathResolver {

    /**
     * @param outputDirectory target directory, or null for the directory holding the source file
     */
    public Path resolve(Path source, Path outputDirectory, String sheetName, OutputFormat format) {
        Path directory = targetDirectory(source, outputDirectory);
        return directory.resolve(stem(source) + "." + sheetName + "." + format.getExtension());
    }

    public Path targetDirectory(Path source, Path outputDirectory) {
        if (outputDirectory != null) {
            return outputDirectory;
        }
        Path parent = source.toAbsolutePath().getParent();
        return parent != null ? parent : source.toAbsolutePath().getRoot();
    }

    /**
     * Creates {@code directory} (and missing parents) unless it already exists.
     *
     * @throws OutputLocationException if the path exists as something other than a directory
     *                                 or cannot be created
     */
    public void prepareDirectory(Path directory) {
        if (Files.isDirectory(directory)) {
            return;
        }
        if (Files.exists(directory)) {
            throw new OutputLocationException(directory, "exists and is not a directory");
        }
        try {
            Files.createDirectories(directory);
        } catch (FileAlreadyExistsException e) {
            throw new OutputLocationException(directory, "a path component exists and is not a directory");
        } catch (IOException e) {
            throw new OutputLocationException(directory, e);
        }
    }

    static String stem(Path source) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
