package io.kubetest.systemtest;

import io.kubetest.junit5.KubeTest;
import io.kubetest.systemtest.framework.IndicativeSentences;
import org.junit.jupiter.api.DisplayNameGeneration;

/**
 * Base systemtest class which should be derived in every ST class.
 * Every test method runs in its own namespace, everything it creates is deleted after it.
 */
@KubeTest(timeoutSeconds = 600)
@DisplayNameGeneration(IndicativeSentences.class)
public abstract class AbstractST {
}
