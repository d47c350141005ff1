package com.agentflow.core.spi;

import com.agentflow.core.model.ActivityEntry;
import java.util.List;

/**
 * Append-only global activity feed.
 */
public interface ActivityLog {

    void log(ActivityEntry entry);

    List<ActivityEntry> recent(int limit);
}
