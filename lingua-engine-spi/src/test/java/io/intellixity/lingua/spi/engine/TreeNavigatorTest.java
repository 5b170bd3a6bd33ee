package io.intellixity.lingua.spi.engine;

import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.testkit.Application;
import io.intellixity.lingua.testkit.Button;
import io.intellixity.lingua.testkit.Form;
import io.intellixity.lingua.testkit.Panel;
import io.intellixity.lingua.testkit.Widgets;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TreeNavigatorTest {
  @Test
  void visitsDescendantsInPreOrderWithQualifiedNames() {
    List<String> names = new ArrayList<>();
    TreeNavigator.forEachDescendant(Widgets.sampleTree(), c -> true, (qn, c) -> names.add(qn));
    assertEquals(List.of(
        "Form1",
        "Form1.Panel1",
        "Form1.Panel1.Button1",
        "Form1.Panel1.Label1",
        "Form1.Button2",
        "Form1.Edit1",
        "Form1.ListBox1"), names);
  }

  @Test
  void excludedContainerHidesItsSubtree() {
    List<String> names = new ArrayList<>();
    TreeNavigator.forEachDescendant(Widgets.sampleTree(), c -> !(c instanceof Panel), (qn, c) -> names.add(qn));
    assertFalse(names.contains("Form1.Panel1"));
    assertFalse(names.contains("Form1.Panel1.Button1"));
    assertTrue(names.contains("Form1.Button2"));
  }

  @Test
  void resolvesPathSegmentBySegmentIgnoringCase() {
    Application app = Widgets.sampleTree();
    assertSame(Widgets.button1(app), TreeNavigator.resolve(app, "Form1.Panel1.Button1", c -> true));
    assertSame(Widgets.button1(app), TreeNavigator.resolve(app, "form1.panel1.button1", c -> true));
    assertNull(TreeNavigator.resolve(app, "", c -> true));
  }

  @Test
  void fallsBackToLeafNameSearchWhenAncestorWasRenamed() {
    Application app = Widgets.sampleTree();
    assertSame(Widgets.button1(app), TreeNavigator.resolve(app, "Form1.OldPanel.Button1", c -> true));
    assertNull(TreeNavigator.resolve(app, "Form1.OldPanel.Missing", c -> true));
  }

  @Test
  void fallbackBindsFirstContainerSharingTheLeafName() {
    Application app = new Application("App");
    Form first = app.add(new Form("First"));
    Button a = first.add(new Button("Ok"));
    Form second = app.add(new Form("Second"));
    second.add(new Button("Ok"));

    Container resolved = TreeNavigator.resolve(app, "Renamed.Ok", c -> true);
    assertSame(a, resolved);
  }

  @Test
  void excludedContainersAreNeverResolved() {
    Application app = Widgets.sampleTree();
    assertNull(TreeNavigator.resolve(app, "Form1.Panel1.Button1", c -> !(c instanceof Panel)));
  }
}
