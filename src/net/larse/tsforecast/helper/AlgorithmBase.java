/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsforecast.helper;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared plumbing for the configurable algorithms.
 *
 * <p>Each algorithm declares a nested {@code Args} class extending {@link ArgsBase}. The public
 * fields hold the defaults and are documented with {@link ArgsBase.Doc}; a caller creates an
 * {@code Args}, overrides what it needs and hands it to the algorithm's constructor, which keeps
 * its own copy.
 */
public final class AlgorithmBase {
  private AlgorithmBase() {}

  public abstract static class ArgsBase implements Cloneable {
    /** Help text for an argument. */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Doc {
      String help();
    }

    /** Marks an argument with a usable default. */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Optional {}

    /**
     * Returns the documented arguments and their current values, in declaration order.
     */
    public Map<String, Object> values() {
      Map<String, Object> values = new LinkedHashMap<>();
      for (Field field : getClass().getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || !field.isAnnotationPresent(Doc.class)) {
          continue;
        }
        try {
          field.setAccessible(true);
          values.put(field.getName(), field.get(this));
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Cannot read argument " + field.getName(), e);
        }
      }
      return values;
    }

    /**
     * A field-by-field copy. Algorithms keep a copy of the arguments they validated, so later
     * changes to the caller's instance do not reach them.
     */
    @SuppressWarnings("unchecked")
    public <T extends ArgsBase> T copy() {
      try {
        return (T) clone();
      } catch (CloneNotSupportedException e) {
        throw new AssertionError(e);
      }
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + values();
    }
  }
}
