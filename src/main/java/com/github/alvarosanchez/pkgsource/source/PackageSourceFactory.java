package com.github.alvarosanchez.pkgsource.source;

import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates package sources from their descriptors.
 */
public interface PackageSourceFactory {

    /**
     * Creates the source a descriptor points at.
     *
     * @param descriptor source descriptor
     * @return package source
     */
    PackageSource create(PackageSourceDescriptor descriptor);

    /**
     * Creates one source per descriptor, behind a composite when there is more than one.
     *
     * @param descriptors descriptors in query order
     * @return single source, or composite source
     */
    default PackageSource create(List<PackageSourceDescriptor> descriptors) {
        if (descriptors.size() == 1) {
            return create(descriptors.get(0));
        }
        List<PackageSource> sources = new ArrayList<>();
        for (PackageSourceDescriptor descriptor : descriptors) {
            sources.add(create(descriptor));
        }
        return new CompositePackageSource(sources);
    }
}
