/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
*/

package org.semql.common.util;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Reflection helpers for pluggable implementations named in configuration.
 */
public class ClassUtil {

    @SuppressWarnings("unchecked")
    public static <T> Class<? extends T> forName(String name, Class<T> clz) throws ClassNotFoundException {
        Class<?> found = Class.forName(name, true, Thread.currentThread().getContextClassLoader() == null ? ClassUtil.class.getClassLoader() : Thread.currentThread().getContextClassLoader());
        if (!clz.isAssignableFrom(found)) {
            throw new ClassCastException(name + " is not a " + clz.getName());
        }
        return (Class<? extends T>) found;
    }

    /**
     * Instantiate through the single-argument constructor accepting {@code arg}'s type,
     * falling back to the no-arg constructor.
     */
    public static <T> T newInstance(String clzName, Class<T> interfaceClz, Object arg) {
        Class<? extends T> clz;
        try {
            clz = forName(clzName, interfaceClz);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Implementation class not found: " + clzName, e);
        }

        try {
            for (Constructor<?> ctor : clz.getConstructors()) {
                Class<?>[] params = ctor.getParameterTypes();
                if (params.length == 1 && arg != null && params[0].isAssignableFrom(arg.getClass())) {
                    return interfaceClz.cast(ctor.newInstance(arg));
                }
            }
            return clz.getConstructor().newInstance();
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Failed to create " + clzName, e.getTargetException());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create " + clzName, e);
        }
    }
}
