/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * An ordered pair of variables: the directed constraint that {@link #x}'s
 * candidates must each be supported by some candidate of {@link #y}.
 */
@Immutable
public final class Arc {

  public final Variable x;
  public final Variable y;

  public static Arc of(Variable x, Variable y) {
    return new Arc(x, y);
  }

  private Arc(Variable x, Variable y) {
    this.x = checkNotNull(x);
    this.y = checkNotNull(y);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Arc)) return false;
    Arc that = (Arc) o;
    return this.x.equals(that.x) && this.y.equals(that.y);
  }

  @Override public int hashCode() {
    return Objects.hashCode(x, y);
  }

  @Override public String toString() {
    return x + " \u2192 " + y;  // That's a right arrow
  }
}
