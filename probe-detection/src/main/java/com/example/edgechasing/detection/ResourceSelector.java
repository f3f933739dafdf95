package com.example.edgechasing.detection;

import java.util.List;

/** Decides which resources a process asks for when it has no outstanding requests. */
@FunctionalInterface
public interface ResourceSelector {
    List<Resource> select(List<Resource> pool);
}
