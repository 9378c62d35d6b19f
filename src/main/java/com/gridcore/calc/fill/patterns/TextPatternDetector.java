package com.gridcore.calc.fill.patterns;

import com.gridcore.calc.api.PatternDetector;
import com.gridcore.calc.fill.PatternType;
import com.gridcore.calc.model.CellValue;

import java.util.List;
import java.util.Optional;

/**
 * Text with a shared prefix and suffix around a counter that goes up by one,
 * e.g. {@code Item 1, Item 2, Item 3}.
 */
public class TextPatternDetector implements PatternDetector {

    @Override
    public boolean canHandle(List<CellValue> values) {
        if (values.size() < 2)
            return false;
        for (CellValue v : values)
            if (!v.isText())
                return false;
        return true;
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        NumberedText previous = null;
        for (CellValue v : values) {
            Optional<NumberedText> parsed = NumberedText.parse(((CellValue.Text) v).value());
            if (parsed.isEmpty())
                return Optional.empty();
            NumberedText current = parsed.get();
            if (previous != null && (!current.sameShape(previous) || current.number() != previous.number() + 1))
                return Optional.empty();
            previous = current;
        }
        return Optional.of(new PatternType.Text());
    }

    @Override
    public int priority() {
        return 50;
    }
}
