package ac.tiercache;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

// CacheLevel.java - tiers ordered from fastest to slowest
public enum CacheLevel {
    L1("memory"),
    L2("redis"),
    L3("disk");

    private final String description;

    CacheLevel(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static Set<CacheLevel> all() {
        return EnumSet.allOf(CacheLevel.class);
    }

    public static Set<CacheLevel> of(Collection<CacheLevel> levels) {
        if (levels == null || levels.isEmpty()) {
            return all();
        }
        return EnumSet.copyOf(levels);
    }
}
