package com.example.redditextractor;

import com.example.redditextractor.model.RedditPost;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Excel workbook with a single {@value #SHEET_NAME} sheet. Vote and comment counts are numeric cells.
 */
public final class XlsxRowFormat implements RowFormat {
    private static final Logger LOGGER = LoggerFactory.getLogger(XlsxRowFormat.class);
    static final String SHEET_NAME = "posts";
    static final int MAX_CELL_LENGTH = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    @Override
    public List<RedditPost> read(Path path) throws IOException {
        List<RedditPost> posts = new ArrayList<>();
        DataFormatter formatter = new DataFormatter();
        try (InputStream in = Files.newInputStream(path); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheet(SHEET_NAME);
            if (sheet == null) {
                sheet = workbook.getSheetAt(0);
            }
            for (Row row : sheet) {
                String[] values = new String[HEADERS.size()];
                for (int i = 0; i < values.length; i++) {
                    Cell cell = row.getCell(i);
                    values[i] = cell == null ? "" : formatter.formatCellValue(cell);
                }
                if (PostRows.isHeader(values)) {
                    continue;
                }
                RedditPost post = PostRows.fromRow(values);
                if (post != null) {
                    posts.add(post);
                }
            }
        }
        return posts;
    }

    @Override
    public void write(List<RedditPost> posts, Path path) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(path)) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            Row header = sheet.createRow(0);
            for (int i = 0; i < HEADERS.size(); i++) {
                header.createCell(i).setCellValue(HEADERS.get(i));
            }
            int rowIndex = 1;
            for (RedditPost post : posts) {
                String[] values = PostRows.toRow(post);
                Row row = sheet.createRow(rowIndex++);
                for (int i = 0; i < values.length; i++) {
                    Cell cell = row.createCell(i);
                    if (i == 4) {
                        cell.setCellValue(post.votes());
                    } else if (i == 5) {
                        cell.setCellValue(post.comments());
                    } else {
                        cell.setCellValue(fit(values[i], post.id(), HEADERS.get(i)));
                    }
                }
            }
            workbook.write(out);
        }
    }

    @Override
    public String extension() {
        return "xlsx";
    }

    private static String fit(String value, String id, String column) {
        if (value.length() <= MAX_CELL_LENGTH) {
            return value;
        }
        LOGGER.warn("Truncating {} of post {} from {} to {} characters", column, id, value.length(), MAX_CELL_LENGTH);
        return value.substring(0, MAX_CELL_LENGTH);
    }
}
