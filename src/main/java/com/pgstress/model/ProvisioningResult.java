package com.pgstress.model;

import java.util.List;

/**
 * Outcome of the table provisioning phase.
 *
 * @param requested number of tables asked for
 * @param attempts naming attempts consumed from the global budget
 * @param tables tables actually created, in creation order
 * @param failed creation attempts that ended in an error
 * @param collisions generated names that already existed in the catalog
 * @param budgetExhausted true when provisioning stopped because the attempt budget ran out
 */
public record ProvisioningResult(
    int requested,
    int attempts,
    List<TableDescriptor> tables,
    int failed,
    int collisions,
    boolean budgetExhausted
) {
    public ProvisioningResult {
        tables = List.copyOf(tables);
    }

    public int created() {
        return tables.size();
    }

    public boolean isComplete() {
        return created() == requested;
    }
}
