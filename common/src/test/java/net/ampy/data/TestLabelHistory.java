// This file is part of ampy.
// Copyright (C) 2013-2026  The ampy Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.ampy.data;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public final class TestLabelHistory {

  @Test
  public void merge() {
    final LabelHistory first = new LabelHistory();
    first.points().add(new DataPoint(0, 0).set("rtt", 1L));
    
    final LabelHistory second = new LabelHistory();
    second.setFrequency(60);
    second.points().add(new DataPoint(3600, 3600).set("rtt", 2L));
    second.timedOut().add(new TimeRange(7200, 10799));
    
    first.merge(second);
    assertEquals(60, first.frequency());
    assertEquals(2, first.points().size());
    assertEquals(3600, first.points().get(1).binstart());
    assertEquals(Arrays.asList(new TimeRange(7200, 10799)), first.timedOut());
    
    // existing frequency wins
    final LabelHistory third = new LabelHistory();
    third.setFrequency(300);
    first.merge(third);
    assertEquals(60, first.frequency());
    
    first.merge(null);
    assertEquals(2, first.points().size());
  }

  @Test
  public void labelDefaults() {
    final Label label = new Label("group_1_IPv4", Arrays.asList(1L, 2L));
    assertEquals("group_1_IPv4", label.shortLabel());
    assertEquals(Arrays.asList(3L), 
        label.withStreams(Arrays.asList(3L)).streams());
    assertEquals("All", 
        new Label("group_1", Arrays.asList(1L), "All").shortLabel());
  }

  @Test(expected = IllegalArgumentException.class)
  public void aggregationSizeMismatch() {
    new Aggregation(Arrays.asList("rtt", "loss"), Arrays.asList("avg"));
  }
}
