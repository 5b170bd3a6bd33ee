package io.intellixity.lingua.testkit;

import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.core.model.ContainerType;
import io.intellixity.lingua.core.model.ContainerTypeRegistry;

/** Attribute metadata for the fixture widgets and a ready-made sample tree. */
public final class Widgets {
  private Widgets() {}

  public static ContainerTypeRegistry registry() {
    return new ContainerTypeRegistry()
        .register(ContainerType.builder(Form.class).named("TForm")
            .readOnlyText("Name", Container::name)
            .text("Caption", Form::getCaption, Form::setCaption)
            .text("Hint", Widget::getHint, Widget::setHint)
            .build())
        .register(ContainerType.builder(Panel.class).named("TPanel")
            .text("Caption", Panel::getCaption, Panel::setCaption)
            .text("Hint", Widget::getHint, Widget::setHint)
            .build())
        .register(ContainerType.builder(Button.class).named("TButton")
            .readOnlyText("Name", Container::name)
            .text("Caption", Button::getCaption, Button::setCaption)
            .text("Hint", Widget::getHint, Widget::setHint)
            .text("HelpKeyword", Button::getHelpKeyword, Button::setHelpKeyword)
            .internalText("Tag", Button::getTag, Button::setTag)
            .nested("Tooltip", Button::getTooltip)
            .build())
        .register(ContainerType.builder(Label.class).named("TLabel")
            .text("Caption", Label::getCaption, Label::setCaption)
            .text("Hint", Widget::getHint, Widget::setHint)
            .build())
        .register(ContainerType.builder(Edit.class).named("TEdit")
            .text("Text", Edit::getText, Edit::setText)
            .text("Hint", Widget::getHint, Widget::setHint)
            .build())
        .register(ContainerType.builder(ListBox.class).named("TListBox")
            .textList("Items", ListBox::getItems, ListBox::setItems)
            .text("Hint", Widget::getHint, Widget::setHint)
            .build())
        .register(ContainerType.builder(Tooltip.class).named("TTooltip")
            .text("Title", Tooltip::getTitle, Tooltip::setTitle)
            .text("Body", Tooltip::getBody, Tooltip::setBody)
            .build());
  }

  /**
   * Application "App" owning:\n
   * <pre>
   * Form1 (Caption "Main window")
   *   Panel1 (Caption "Options")
   *     Button1 (Caption "OK", Hint "Confirm")
   *     Label1 (Caption "Line one\nLine two")
   *   Button2 (bound to an action: Caption "Open", Hint "Open a file")
   *   Edit1 (Text "type here")
   *   ListBox1 (Items "Red", "Green", "Blue")
   * </pre>
   */
  public static Application sampleTree() {
    Application app = new Application("App");
    Form form = app.add(new Form("Form1", "Main window"));
    Panel panel = form.add(new Panel("Panel1", "Options"));
    Button ok = panel.add(new Button("Button1", "OK"));
    ok.setHint("Confirm");
    ok.getTooltip().setTitle("Confirm");
    ok.getTooltip().setBody("Apply the changes");
    panel.add(new Label("Label1", "Line one\nLine two"));
    Button open = form.add(new Button("Button2"));
    open.setAction(new Action("Open", "Open a file"));
    form.add(new Edit("Edit1", "type here"));
    form.add(new ListBox("ListBox1", "Red", "Green", "Blue"));
    return app;
  }

  public static Form form(Application app) {
    return (Form) app.findChild("Form1");
  }

  public static Panel panel(Application app) {
    return (Panel) form(app).findChild("Panel1");
  }

  public static Button button1(Application app) {
    return (Button) panel(app).findChild("Button1");
  }

  public static Label label1(Application app) {
    return (Label) panel(app).findChild("Label1");
  }

  public static Button button2(Application app) {
    return (Button) form(app).findChild("Button2");
  }

  public static Edit edit1(Application app) {
    return (Edit) form(app).findChild("Edit1");
  }

  public static ListBox listBox1(Application app) {
    return (ListBox) form(app).findChild("ListBox1");
  }
}
