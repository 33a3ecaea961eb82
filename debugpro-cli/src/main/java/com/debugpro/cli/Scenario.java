package com.debugpro.cli;

/**
 * 演示场景，每个错误类别一个。
 */
enum Scenario {

    KEY {
        @Override
        void trigger() throws Exception { Scenarios.keyLookup(); }
    },
    INDEX {
        @Override
        void trigger() throws Exception { Scenarios.indexRange(); }
    },
    TYPE {
        @Override
        void trigger() throws Exception { Scenarios.typeMismatch(); }
    },
    ATTRIBUTE {
        @Override
        void trigger() throws Exception { Scenarios.memberNotFound(); }
    },
    NAME {
        @Override
        void trigger() throws Exception { Scenarios.undefinedName(); }
    },
    OTHER {
        @Override
        void trigger() throws Exception { Scenarios.other(); }
    };

    abstract void trigger() throws Exception;
}
