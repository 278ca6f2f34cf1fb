package br.com.analytics.pipeline.marketing_preprocess_batch.processor;

import br.com.analytics.pipeline.marketing_preprocess_batch.model.CellValue;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.RawRow;
import br.com.analytics.pipeline.marketing_preprocess_batch.model.StagedRecord;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds the region groups of a wide row by value kind rather than by column offset.
 *
 * <p>A text cell opens a group (closing the previous one), the numbers after it fill
 * {@code regional_sales} then {@code product_id}, and further numbers are surplus. A blank cell
 * inside an open group still uses up its slot, so a missing sales cell cannot pull the product id
 * into the sales field. Numbers before the first region are ignored.
 */
public class AdaptiveUnpivoter {

    public List<StagedRecord> unpivot(RawRow row) {
        List<StagedRecord> records = new ArrayList<>();
        GroupAccumulator group = null;

        for (String raw : row.groupCells()) {
            CellValue cell = CellValue.classify(raw);

            if (cell == null) {
                if (group != null) {
                    group.skipSlot();
                }
                continue;
            }

            if (cell.isText()) {
                if (group != null) {
                    records.add(group.toRecord(row));
                }
                group = new GroupAccumulator(cell.text());
            } else if (group != null) {
                group.accept(cell.text());
            }
        }

        if (group != null) {
            records.add(group.toRecord(row));
        }
        return records;
    }

    private static final class GroupAccumulator {

        private static final int SALES_SLOT = 0;
        private static final int PRODUCT_SLOT = 1;
        private static final int COMPLETE = 2;

        private final String region;
        private @Nullable String regionalSales;
        private @Nullable String productId;
        private int slot = SALES_SLOT;

        private GroupAccumulator(String region) {
            this.region = region;
        }

        private void accept(String number) {
            if (slot == SALES_SLOT) {
                regionalSales = number;
            } else if (slot == PRODUCT_SLOT) {
                productId = number;
            }
            skipSlot();
        }

        private void skipSlot() {
            if (slot < COMPLETE) {
                slot++;
            }
        }

        private StagedRecord toRecord(RawRow row) {
            return StagedRecord.fromRow(row, region, regionalSales, productId);
        }
    }
}
