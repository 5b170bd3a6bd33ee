package io.intellixity.lingua.examples.screen;

import io.intellixity.lingua.core.model.ContainerType;
import io.intellixity.lingua.core.model.ContainerTypeRegistry;

import java.util.List;

/** Attribute metadata and sample content of the demo screen. */
public final class DemoScreens {
  private DemoScreens() {}

  public static ContainerTypeRegistry registry() {
    return new ContainerTypeRegistry()
        .register(ContainerType.builder(Screen.class)
            .text("Caption", Screen::getTitle, Screen::setTitle)
            .text("Hint", ScreenElement::getTooltip, ScreenElement::setTooltip)
            .build())
        .register(ContainerType.builder(Section.class)
            .text("Caption", Section::getHeading, Section::setHeading)
            .text("Hint", ScreenElement::getTooltip, ScreenElement::setTooltip)
            .build())
        .register(ContainerType.builder(Field.class)
            .text("Caption", Field::getLabel, Field::setLabel)
            .text("Placeholder", Field::getPlaceholder, Field::setPlaceholder)
            .text("Hint", ScreenElement::getTooltip, ScreenElement::setTooltip)
            .textList("Items", Field::getChoices, Field::setChoices)
            .build())
        .register(ContainerType.builder(Command.class)
            .text("Caption", Command::getCaption, Command::setCaption)
            .text("Hint", ScreenElement::getTooltip, ScreenElement::setTooltip)
            .build());
  }

  /** "OrderScreen" with a customer section, an order section and two commands. */
  public static Screen orderScreen() {
    Screen screen = new Screen("OrderScreen", "New order");
    Section customer = screen.add(new Section("Customer", "Customer"));
    customer.add(new Field("FullName", "Full name", "First and last name"));
    customer.add(new Field("Email", "E-mail", "name@example.com"));
    Section order = screen.add(new Section("Order", "Order"));
    Field size = order.add(new Field("Size", "Size", "Pick a size"));
    size.setChoices(List.of("Small", "Medium", "Large"));
    Field notes = order.add(new Field("Notes", "Notes", "Delivery notes"));
    notes.setTooltip("Shown to the courier\nKeep it short");
    Command submit = screen.add(new Command("Submit", "Place order", false));
    submit.setTooltip("Send the order");
    screen.add(new Command("Close", "Close", true));
    return screen;
  }
}
