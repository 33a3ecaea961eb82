package com.debugpro.cli;

import debugpro.runtime.Frames;
import debugpro.runtime.Lookups;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会失败的示例代码。报告会读取本文件展示源码上下文，改动时注意故障行要包含绑定名。
 */
final class Scenarios {

    private Scenarios() {}

    static void keyLookup() throws Exception {
        Frames.run("keyLookup", locals -> {
            Map<String, Integer> myDict = locals.bind("myDict", new LinkedHashMap<String, Integer>());
            myDict.put("a", 1);
            myDict.put("b", 2);
            myDict.put("c", 3);
            Lookups.get(myDict, "z");
        });
    }

    static void indexRange() throws Exception {
        Frames.run("indexRange", locals -> {
            List<Integer> items = locals.bind("items", Arrays.asList(1, 2, 3));
            int index = locals.bind("index", 5);
            System.out.println(items.get(index));
        });
    }

    static void typeMismatch() throws Exception {
        Frames.run("typeMismatch", locals -> {
            Object payload = locals.bind("payload", Arrays.asList("x", "y"));
            System.out.println(((String) payload).length());
        });
    }

    static void memberNotFound() throws Exception {
        Frames.run("memberNotFound", locals -> {
            Map<String, Integer> myDict = locals.bind("myDict", new HashMap<String, Integer>());
            myDict.put("a", 1);
            myDict.getClass().getMethod("grab_item", Object.class).invoke(myDict, "a");
        });
    }

    static void undefinedName() throws Exception {
        Frames.run("undefinedName", locals -> {
            locals.bind("counter", 1);
            locals.bind("total", 10);
            System.out.println(locals.lookup("count"));
        });
    }

    static void other() throws Exception {
        Frames.run("other", locals -> {
            locals.bind("ratio", 0.75);
            throw new IllegalStateException("worker pool is shut down");
        });
    }
}
