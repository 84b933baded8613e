package quest.gekko.searchvolume.service.core.model;

import quest.gekko.searchvolume.domain.Capability;

public record MergedInterval(Capability capability, DateRange range) {

    public boolean grants(final Capability requested) {
        return capability.implies(requested);
    }
}
