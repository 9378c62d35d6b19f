package com.gridcore.calc.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridcore.calc.Spreadsheet;
import com.gridcore.calc.api.CellStore;
import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * JSON image of a sheet's cells: the raw input of every cell together with
 * its computed value and error message.
 *
 * <p>
 * Restoring replays the raw inputs, so computed values are recomputed rather
 * than trusted.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class SheetSnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private long epoch;
    private List<CellDef> cells = new ArrayList<>();

    /** One stored cell. {@code raw} is the formula text for formula cells. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CellDef {
        private String address, raw, value, type, error;
    }

    public static SheetSnapshot capture(Spreadsheet sheet) {
        SheetSnapshot snapshot = new SheetSnapshot();
        snapshot.setEpoch(sheet.epoch());
        CellStore store = sheet.cells();
        for (CellAddress a : store.addresses()) {
            Cell cell = store.get(a);
            CellDef def = new CellDef();
            def.setAddress(a.toA1());
            def.setRaw(cell.getRawValue().toDisplayString());
            def.setValue(cell.getComputedValue().toDisplayString());
            def.setType(cell.getComputedValue().typeName());
            def.setError(cell.getError());
            snapshot.getCells().add(def);
        }
        return snapshot;
    }

    /** Writes every cell's raw input into {@code sheet}; other cells of the sheet are left alone. */
    public void restoreInto(Spreadsheet sheet) {
        for (CellDef def : cells)
            sheet.setCell(CellAddress.fromA1(def.getAddress()), def.getRaw());
    }

    public String toJson() throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }

    public static SheetSnapshot fromJson(String json) throws IOException {
        return MAPPER.readValue(json, SheetSnapshot.class);
    }
}
