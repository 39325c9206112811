package com.example.redditextractor;

import com.example.redditextractor.model.RedditPost;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class CsvRowFormat implements RowFormat {

    @Override
    public List<RedditPost> read(Path path) throws IOException {
        List<RedditPost> posts = new ArrayList<>();
        // RFC 4180 quoting to match the writer; backslashes in post text stay literal
        try (CSVReader reader = new CSVReaderBuilder(Files.newBufferedReader(path, StandardCharsets.UTF_8))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (PostRows.isHeader(row)) {
                    continue;
                }
                RedditPost post = PostRows.fromRow(row);
                if (post != null) {
                    posts.add(post);
                }
            }
        } catch (CsvValidationException ex) {
            throw new IOException("Malformed CSV in " + path + ": " + ex.getMessage(), ex);
        }
        return posts;
    }

    @Override
    public void write(List<RedditPost> posts, Path path) throws IOException {
        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(path, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {
            writer.writeNext(HEADERS.toArray(new String[0]));
            for (RedditPost post : posts) {
                writer.writeNext(PostRows.toRow(post));
            }
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("Failed to write CSV " + path);
            }
        }
    }

    @Override
    public String extension() {
        return "csv";
    }
}
