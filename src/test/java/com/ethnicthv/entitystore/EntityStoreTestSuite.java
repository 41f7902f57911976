package com.ethnicthv.entitystore;

import org.junit.platform.suite.api.SelectPackages;
import org.junit.platform.suite.api.Suite;
import org.junit.platform.suite.api.SuiteDisplayName;

/**
 * Runs every entity store test.
 */
@Suite
@SuiteDisplayName("Entity Store Test Suite")
@SelectPackages("com.ethnicthv.entitystore")
public class EntityStoreTestSuite {
}
