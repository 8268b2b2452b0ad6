package com.example.report.docgen.model;

import com.example.report.docgen.style.BlockKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Grid of plain single-line cells. The header row is rendered bold and every
 * data row has the header's column count.
 */
@Value
@Builder
@Jacksonized
public class Table implements Block {
    List<String> headerRow;

    List<List<String>> dataRows;

    public int getColumnCount() {
        return headerRow.size();
    }

    public int getRowCount() {
        return 1 + dataRows.size();
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.TABLE;
    }
}
