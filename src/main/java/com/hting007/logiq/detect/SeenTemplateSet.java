package com.hting007.logiq.detect;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Template ids considered normal for the current run. Starts empty at every cold start.
 */
public class SeenTemplateSet {

    private final Set<String> ids = new LinkedHashSet<>();

    /** Learning phase: everything observed is normal. */
    public void commitAll(Collection<String> templateIds) {
        ids.addAll(templateIds);
    }

    /**
     * @return true when the id was not known before, i.e. this is its first sighting
     */
    public boolean addIfAbsent(String templateId) {
        return ids.add(templateId);
    }

    public int size() {
        return ids.size();
    }
}
