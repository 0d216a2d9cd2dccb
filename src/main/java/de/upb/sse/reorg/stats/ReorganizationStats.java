package de.upb.sse.reorg.stats;

import lombok.Data;

@Data
public class ReorganizationStats {
    private int movedItems;
    private int createdModules;
    private int removedHeaderModules;
    private int droppedImports;
    private int groupedImports;
    private int removedDuplicates;
    private int removedForeignItems;

    public void incrementMovedItems() {
        movedItems++;
    }

    public void addMovedItems(int amount) {
        movedItems += amount;
    }

    public void incrementCreatedModules() {
        createdModules++;
    }

    public void incrementRemovedHeaderModules() {
        removedHeaderModules++;
    }

    public void incrementDroppedImports() {
        droppedImports++;
    }

    public void incrementGroupedImports() {
        groupedImports++;
    }

    public void incrementRemovedDuplicates() {
        removedDuplicates++;
    }

    public void addRemovedForeignItems(int amount) {
        removedForeignItems += amount;
    }

    public int totalChanges() {
        return movedItems + createdModules + removedHeaderModules + droppedImports
                + groupedImports + removedDuplicates + removedForeignItems;
    }

    public boolean changedAnything() {
        return totalChanges() > 0;
    }

    // reset between runs so counts do not accumulate
    public void reset() {
        movedItems = createdModules = removedHeaderModules = droppedImports = 0;
        groupedImports = removedDuplicates = removedForeignItems = 0;
    }
}
